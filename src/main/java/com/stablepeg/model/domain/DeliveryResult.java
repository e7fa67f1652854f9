package com.stablepeg.model.domain;

public record DeliveryResult(boolean success, String detail) {

    public static DeliveryResult delivered() {
        return new DeliveryResult(true, "OK");
    }

    public static DeliveryResult failed(String detail) {
        return new DeliveryResult(false, detail);
    }
}
