package com.open_banking_archiver.model;

import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Bank {

    private Long id;

    private String name;

    // Institution id on the provider side (UNIQUE)
    private String externalId;

    private ProviderType providerType;

    // Null or empty when no link is tracked
    private String activeRequisitionId;

    // Set once a reminder went out for the current unlinked episode
    private boolean activationEmailSent;

    public boolean hasActiveRequisition() {
        return activeRequisitionId != null && !activeRequisitionId.isBlank();
    }
}
