package org.carball.abacus.model.result;

public record DateUsers(String date, long users) {}
