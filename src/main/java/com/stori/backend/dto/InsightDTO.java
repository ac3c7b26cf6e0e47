package com.stori.backend.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class InsightDTO {
    private String type; // warning, success, info, alert
    private String message;
    private String category;
}
