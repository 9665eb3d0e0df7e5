package com.example.OfferScan.service;

public record HttpExchange<T>(T data, int status, String requestId, String endpoint) {
}
