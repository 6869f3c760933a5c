package com.open_banking_archiver.service;

public class BankNotFoundException extends RuntimeException {

    public BankNotFoundException(String bankName) {
        super("Unable to find bank with name '" + bankName + "'");
    }
}
