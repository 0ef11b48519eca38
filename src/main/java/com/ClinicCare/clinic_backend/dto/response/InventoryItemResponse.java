package com.ClinicCare.clinic_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InventoryItemResponse {
    private UUID id;
    private UUID tenantId;
    private String itemName;
    private int quantity;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
