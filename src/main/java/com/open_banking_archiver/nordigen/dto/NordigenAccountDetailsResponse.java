package com.open_banking_archiver.nordigen.dto;

/** GET /accounts/{id}/details/ - minimal */
public record NordigenAccountDetailsResponse(
        Details account
) {
    public record Details(
            String resourceId,
            String iban,
            String currency,
            String name,
            String product,
            String details,
            String ownerName
    ) {
        /** Best human readable label: the free text description, then the account or product name. */
        public String displayName() {
            if (details != null && !details.isBlank()) return details;
            if (name != null && !name.isBlank()) return name;
            if (product != null && !product.isBlank()) return product;
            return resourceId;
        }
    }
}
