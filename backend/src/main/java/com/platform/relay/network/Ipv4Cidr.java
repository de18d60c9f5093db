package com.platform.relay.network;

import java.util.Optional;

/**
 * An IPv4 block in CIDR form. Host bits of the parsed address are cleared.
 */
public record Ipv4Cidr(long network, int prefix) {

    private static final long ADDRESS_SPACE = 1L << 32;

    public Ipv4Cidr {
        if (prefix < 0 || prefix > 32) {
            throw new IllegalArgumentException("Invalid prefix length: " + prefix);
        }
        network = network & mask(prefix);
    }

    public static Ipv4Cidr parse(String cidr) {
        if (cidr == null) {
            throw new IllegalArgumentException("CIDR must not be null");
        }
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Not a CIDR block: " + cidr);
        }
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix in " + cidr, e);
        }
        return new Ipv4Cidr(parseAddress(cidr.substring(0, slash).trim()), prefix);
    }

    /**
     * Parse if the value is an IPv4 CIDR, empty for IPv6 or garbage.
     */
    public static Optional<Ipv4Cidr> tryParse(String cidr) {
        try {
            return Optional.of(parse(cidr));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public long size() {
        return 1L << (32 - prefix);
    }

    public long lastAddress() {
        return network + size() - 1;
    }

    public boolean contains(Ipv4Cidr other) {
        return other.network >= network && other.lastAddress() <= lastAddress();
    }

    public boolean overlaps(Ipv4Cidr other) {
        return network <= other.lastAddress() && other.network <= lastAddress();
    }

    /**
     * Number of sub-blocks of the given prefix length inside this block.
     */
    public int blockCount(int subPrefix) {
        requireSubPrefix(subPrefix);
        return (int) (size() >> (32 - subPrefix));
    }

    public Ipv4Cidr block(int index, int subPrefix) {
        requireSubPrefix(subPrefix);
        if (index < 0 || index >= blockCount(subPrefix)) {
            throw new IndexOutOfBoundsException("Block " + index + " outside " + this);
        }
        return new Ipv4Cidr(network + ((long) index << (32 - subPrefix)), subPrefix);
    }

    /**
     * Dotted address at the given offset from the network address.
     */
    public String address(int offset) {
        if (offset < 0 || offset >= size()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside " + this);
        }
        return format(network + offset);
    }

    @Override
    public String toString() {
        return format(network) + "/" + prefix;
    }

    private void requireSubPrefix(int subPrefix) {
        if (subPrefix < prefix || subPrefix > 32) {
            throw new IllegalArgumentException("/" + subPrefix + " is not a sub-block of " + this);
        }
    }

    private static long mask(int prefix) {
        return prefix == 0 ? 0 : (ADDRESS_SPACE - 1) & ~((1L << (32 - prefix)) - 1);
    }

    private static long parseAddress(String address) {
        String[] octets = address.split("\\.");
        if (octets.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + address);
        }
        long value = 0;
        for (String octet : octets) {
            int part;
            try {
                part = Integer.parseInt(octet);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an IPv4 address: " + address, e);
            }
            if (part < 0 || part > 255) {
                throw new IllegalArgumentException("Not an IPv4 address: " + address);
            }
            value = (value << 8) | part;
        }
        return value;
    }

    private static String format(long address) {
        return ((address >> 24) & 0xFF) + "." + ((address >> 16) & 0xFF) + "."
            + ((address >> 8) & 0xFF) + "." + (address & 0xFF);
    }
}
