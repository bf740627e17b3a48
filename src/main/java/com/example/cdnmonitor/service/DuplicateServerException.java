package com.example.cdnmonitor.service;

public class DuplicateServerException extends RuntimeException {

    public DuplicateServerException(String hostname) {
        super("Ya existe un servidor con hostname '" + hostname + "'");
    }
}
