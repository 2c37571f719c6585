package com.auraide.sandbox.model;

public record PortForward(int internalPort, int externalPort, String url) {}
