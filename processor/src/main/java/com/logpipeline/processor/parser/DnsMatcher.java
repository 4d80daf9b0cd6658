package com.logpipeline.processor.parser;

import java.util.List;

/**
 * BIND-style query lines:
 * {@code <ts> client <ip> query: <domain> IN <type> <flags> (<server>) <rcode>}.
 * The whole line must match.
 */
public class DnsMatcher extends GrokLogFormatMatcher {

    public DnsMatcher() {
        super("^%{DNS_QUERY_LINE}$",
            List.of("timestamp", "client_ip", "query_domain", "query_type", "server_ip", "response_code"));
    }

    @Override
    public LogType type() {
        return LogType.DNS;
    }

    @Override
    public boolean accepts(String line) {
        return line.contains("client") && line.contains("query:");
    }
}
