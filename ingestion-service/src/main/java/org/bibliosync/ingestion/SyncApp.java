package org.bibliosync.ingestion;

import org.bibliosync.ingestion.bootstrap.SyncBootstrap;

public class SyncApp {
    public static void main(String[] args) {
        SyncBootstrap.run();
    }
}
