package io.b2mash.b2b.mediaflow.customer;

public record NewCustomer(String partnerId, String firstName, String lastName, String email) {}
