package com.raditha.mvscan.alias;

import com.raditha.mvscan.model.ExternalStateProxy;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps each canonical call-site key to one external state proxy.
 * Grows monotonically for the duration of one analysis run.
 */
public class AliasRegistry {

    /**
     * Canonical call-site key.
     *
     * @param address  Lower-cased callee address, {@code self} when unknown
     * @param selector Lower-cased selector name
     * @param caller   Contract hosting the call
     */
    public record AliasKey(String address, String selector, String caller) {
    }

    private final Map<AliasKey, ExternalStateProxy> keyToProxy = new HashMap<>();
    private final Map<ExternalStateProxy, Set<AliasKey>> proxyToKeys = new HashMap<>();

    /**
     * Return the proxy for this call site, creating it if new.
     *
     * @param address          callee address expression, may be null
     * @param selector         selector name
     * @param callerFunctionId contract-qualified id of the calling function
     */
    public ExternalStateProxy getOrCreate(String address, String selector, String callerFunctionId) {
        AliasKey key = canonical(address, selector, callerFunctionId);
        ExternalStateProxy proxy = keyToProxy.computeIfAbsent(key,
                k -> new ExternalStateProxy(address, selector));
        proxyToKeys.computeIfAbsent(proxy, p -> new LinkedHashSet<>()).add(key);
        return proxy;
    }

    public Set<AliasKey> keysOf(ExternalStateProxy proxy) {
        return proxyToKeys.getOrDefault(proxy, Set.of());
    }

    public int size() {
        return keyToProxy.size();
    }

    static AliasKey canonical(String address, String selector, String callerFunctionId) {
        String addr = address == null || address.isBlank() ? "self" : address.toLowerCase();
        String caller = callerFunctionId == null ? "" : callerFunctionId;
        int dot = caller.indexOf('.');
        if (dot > 0) {
            caller = caller.substring(0, dot);
        }
        return new AliasKey(addr, selector.toLowerCase(), caller);
    }
}
