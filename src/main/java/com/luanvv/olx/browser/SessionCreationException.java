package com.luanvv.olx.browser;

import com.luanvv.olx.core.CrawlerException;

public class SessionCreationException extends CrawlerException {

    public SessionCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
