package io.concourse.driver.transaction;

public enum TransactionState {
    AUTOCOMMIT,
    STAGED
}
