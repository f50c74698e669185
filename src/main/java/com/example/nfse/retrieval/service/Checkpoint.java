package com.example.nfse.retrieval.service;

/** Throws when the running job was cancelled or ran past its deadline. */
@FunctionalInterface
public interface Checkpoint {

    Checkpoint NONE = () -> {
    };

    void check();
}
