package com.platform.relay.network;

import java.util.List;
import java.util.Map;

/**
 * What the relay needs to know about a Docker network: identity, IPv4 subnets and labels.
 */
public record DockerNetwork(String id, String name, List<Ipv4Cidr> subnets, Map<String, String> labels) {

    public DockerNetwork {
        subnets = subnets == null ? List.of() : List.copyOf(subnets);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public boolean overlaps(Ipv4Cidr cidr) {
        return subnets.stream().anyMatch(subnet -> subnet.overlaps(cidr));
    }
}
