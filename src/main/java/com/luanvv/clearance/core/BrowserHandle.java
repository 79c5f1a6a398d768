package com.luanvv.clearance.core;

import com.luanvv.clearance.dom.DomPage;

/**
 * A running browser with one open page. Closing it tears everything down.
 */
public interface BrowserHandle extends AutoCloseable {

    DomPage page();

    @Override
    void close();
}
