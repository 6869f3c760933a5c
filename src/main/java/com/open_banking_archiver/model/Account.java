package com.open_banking_archiver.model;

import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private Long id;

    // FK -> banks.id
    private Long bankId;

    private String name;

    // Provider resourceId, unique per bank
    private String externalId;
}
