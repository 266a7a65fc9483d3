package com.drawforecast.service.dto;

/**
 * 503 body while the buffer is still filling.
 */
public record NotReadyDTO(String status, String message, int bufferedRecords, int requiredRecords) {

    public static NotReadyDTO of(int bufferedRecords, int requiredRecords) {
        return new NotReadyDTO("NOT_READY",
            "Collecting draw history: " + bufferedRecords + "/" + requiredRecords + " records",
            bufferedRecords, requiredRecords);
    }
}
