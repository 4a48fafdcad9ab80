package net.ipip.ipdb.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An autonomous system entry, embedded as JSON in the {@code asn_info} field
 * of city databases.
 *
 * @param asn      the autonomous system number
 * @param registry the regional internet registry
 * @param country  the country code of the registration
 * @param net      the network name
 * @param org      the organization
 * @param type     the type of the network
 * @param domain   the domain of the organization
 */
public record ASNInfo(
        @JsonProperty("asn") int asn,
        @JsonProperty("reg") String registry,
        @JsonProperty("cc") String country,
        @JsonProperty("net") String net,
        @JsonProperty("org") String org,
        @JsonProperty("type") String type,
        @JsonProperty("domain") String domain
) {
}
