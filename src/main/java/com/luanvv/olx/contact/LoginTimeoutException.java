package com.luanvv.olx.contact;

import com.luanvv.olx.core.CrawlerException;

public class LoginTimeoutException extends CrawlerException {

    public LoginTimeoutException(String message) {
        super(message);
    }
}
