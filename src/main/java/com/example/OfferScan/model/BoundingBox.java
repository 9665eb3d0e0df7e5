package com.example.OfferScan.model;

public record BoundingBox(double x, double y, double width, double height) {
}
