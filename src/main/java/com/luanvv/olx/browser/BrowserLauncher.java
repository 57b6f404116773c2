package com.luanvv.olx.browser;

@FunctionalInterface
public interface BrowserLauncher {

    BrowserSession launch(boolean headless);
}
