package com.opinion.builder.feed;

public record SubscriptionChange(Action action, Subscription subscription) {

    public enum Action { ADDED, REMOVED }
}
