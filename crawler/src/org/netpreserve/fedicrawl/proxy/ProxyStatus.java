package org.netpreserve.fedicrawl.proxy;

public enum ProxyStatus {
    HEALTHY, UNHEALTHY, RATE_LIMITED
}
