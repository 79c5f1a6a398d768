package com.luanvv.clearance.core;

/**
 * States of the listing walk. {@link #EXPANDING} and {@link #PAGINATING} both lead back to
 * {@link #READY}; {@link #DONE} is terminal.
 */
public enum NavState {
    LOADING_INITIAL,
    READY,
    EXPANDING,
    PAGINATING,
    DONE
}
