package com.luanvv.clearance.dom;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.PlaywrightException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Element backed by a Playwright handle. Handles live in the browser until disposed, and a
 * "load more" listing never navigates away, so every handle handed out is tracked here.
 */
@Slf4j
public class PlaywrightNode implements DomNode {
    private final ElementHandle handle;
    private final List<PlaywrightNode> children = new ArrayList<>();

    public PlaywrightNode(ElementHandle handle) {
        this.handle = handle;
    }

    @Override
    public Optional<DomNode> query(String selector) {
        ElementHandle child = handle.querySelector(selector);
        if (child == null) {
            return Optional.empty();
        }
        PlaywrightNode node = new PlaywrightNode(child);
        children.add(node);
        return Optional.of(node);
    }

    @Override
    public String attribute(String name) {
        return handle.getAttribute(name);
    }

    @Override
    public String text() {
        String text = handle.textContent();
        return text == null ? "" : text;
    }

    @Override
    public void dispose() {
        for (PlaywrightNode child : children) {
            child.dispose();
        }
        children.clear();
        try {
            handle.dispose();
        } catch (PlaywrightException e) {
            log.debug("Element handle already gone: {}", e.getMessage());
        }
    }
}
