package com.opinion.builder.controller;

public class TopicNotFoundException extends RuntimeException {

    private final String id;

    public TopicNotFoundException(String id) {
        super("Topic " + id + " not found");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
