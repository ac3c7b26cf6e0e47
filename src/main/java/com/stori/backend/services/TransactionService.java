package com.stori.backend.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.stori.backend.config.StoreProperties;
import com.stori.backend.entities.Transaction;
import com.stori.backend.exceptions.BadRequestException;
import com.stori.backend.repositories.CursorPage;
import com.stori.backend.repositories.TransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionService {

    private final TransactionRepository transactionRepository;
    private final StoreProperties storeProperties;

    public Transaction createTransaction(Transaction request) {
        Transaction transaction = prepare(request);
        return transactionRepository.create(transaction);
    }

    public Transaction getTransaction(String userId, String transactionId) {
        requireText(userId, "userId");
        requireText(transactionId, "transactionId");
        return transactionRepository.get(userId, transactionId);
    }

    /**
     * The request's {@code version} is the one the caller read; 0 skips the early check and relies on the
     * conditional write alone.
     */
    public Transaction updateTransaction(Transaction request) {
        if (request == null) {
            throw new BadRequestException("transaction is required");
        }
        requireText(request.getId(), "transactionId");
        return transactionRepository.update(prepare(request));
    }

    public void deleteTransaction(String userId, String transactionId) {
        requireText(userId, "userId");
        requireText(transactionId, "transactionId");
        transactionRepository.delete(userId, transactionId);
    }

    public CursorPage<Transaction> getTransactionsByUser(String userId, int limit, String cursor) {
        requireText(userId, "userId");
        return transactionRepository.findByUser(userId, pageSize(limit), cursor);
    }

    public CursorPage<Transaction> getTransactionsByMonth(String userId, String month, int limit, String cursor) {
        requireText(userId, "userId");
        return transactionRepository.findByMonth(userId, Months.parse(month), pageSize(limit), cursor);
    }

    public CursorPage<Transaction> getTransactionsByCategory(String userId, String category, int limit, String cursor) {
        requireText(userId, "userId");
        requireText(category, "category");
        return transactionRepository.findByCategory(userId, category, pageSize(limit), cursor);
    }

    /**
     * Validates every entry before writing any of them.
     *
     * @return number of transactions written
     */
    public int importTransactions(List<Transaction> requests) {
        if (requests == null || requests.isEmpty()) {
            return 0;
        }
        List<Transaction> prepared = new ArrayList<>(requests.size());
        for (Transaction request : requests) {
            prepared.add(prepare(request));
        }
        transactionRepository.batchCreate(prepared);
        log.info("Imported {} transactions", prepared.size());
        return prepared.size();
    }

    private Transaction prepare(Transaction request) {
        if (request == null) {
            throw new BadRequestException("transaction is required");
        }
        Instant now = Instant.now();
        Transaction transaction = request.toBuilder()
                .id(isBlank(request.getId()) ? UUID.randomUUID().toString() : request.getId())
                .date(request.getDate() != null ? request.getDate() : now)
                .createdAt(request.getCreatedAt() != null ? request.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        transaction.validate();
        return transaction;
    }

    private int pageSize(int limit) {
        return limit > 0 ? limit : storeProperties.defaultPageSize();
    }

    private static void requireText(String value, String field) {
        if (isBlank(value)) {
            throw new BadRequestException(field + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
