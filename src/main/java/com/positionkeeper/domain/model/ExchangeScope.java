package com.positionkeeper.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Credential + settlement market pair. Every remote call is scoped by one, and positions
 * sharing a scope are polled with a single list call per cycle.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public class ExchangeScope {

    private final String credentialId;
    private final String market;

    @Override
    public String toString() {
        return credentialId + "/" + market;
    }
}
