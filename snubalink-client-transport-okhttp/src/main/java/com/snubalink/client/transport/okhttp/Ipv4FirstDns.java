package com.snubalink.client.transport.okhttp;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import okhttp3.Dns;

/** Orders resolved addresses so IPv4 ones are tried first; the order within each family is kept. */
final class Ipv4FirstDns implements Dns {

    private final Dns delegate;

    Ipv4FirstDns(Dns delegate) {
        this.delegate = delegate;
    }

    @Override
    public List<InetAddress> lookup(String hostname) throws UnknownHostException {
        List<InetAddress> addresses = new ArrayList<>(delegate.lookup(hostname));
        addresses.sort(Comparator.comparingInt(address -> address instanceof Inet4Address ? 0 : 1));
        return addresses;
    }
}
