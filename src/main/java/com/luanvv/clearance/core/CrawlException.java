package com.luanvv.clearance.core;

/**
 * Unrecoverable session failure: the browser could not start or the start page is unreachable.
 */
public class CrawlException extends RuntimeException {

    public CrawlException(String message) {
        super(message);
    }

    public CrawlException(String message, Throwable cause) {
        super(message, cause);
    }
}
