package com.chatui.infra.preflight;

import java.util.Optional;

public interface DnsZoneProvider {

    /**
     * @return id of the public hosted zone serving the domain, empty when there is none
     */
    Optional<String> lookupZone(String domainName);
}
