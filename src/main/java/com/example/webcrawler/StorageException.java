package com.example.webcrawler;

import java.io.IOException;
import java.nio.file.Path;

public class StorageException extends CrawlerException {
    public StorageException(String message, Path path, IOException cause) {
        super(message + " (" + path + "): " + cause.getMessage(), cause);
    }
}
