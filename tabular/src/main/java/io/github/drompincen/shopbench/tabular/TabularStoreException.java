package io.github.drompincen.shopbench.tabular;

public class TabularStoreException extends RuntimeException {

    public TabularStoreException(String message) {
        super(message);
    }

    public TabularStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
