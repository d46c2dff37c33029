package org.netpreserve.fedicrawl.proxy;

import java.util.List;
import java.util.Map;

/**
 * Outcome of registering a batch of proxy entries.
 *
 * @param added      newly registered proxies
 * @param existing   entries that were already registered
 * @param rejected   malformed entries (masked) mapped to the reason they were rejected
 */
public record RegistrationResult(List<ProxyUri> added, List<ProxyUri> existing, Map<String, String> rejected) {
}
