package com.luanvv.olx.contact;

import com.luanvv.olx.core.CrawlerException;
import lombok.Getter;

@Getter
public class ContactFetchException extends CrawlerException {
    private final int status;

    public ContactFetchException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ContactFetchException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public boolean isAuthFailure() {
        return status == 401 || status == 403;
    }

    public boolean isRateLimited() {
        return status == 429;
    }
}
