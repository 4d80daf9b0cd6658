package com.logpipeline.processor.parser;

import java.util.List;

/**
 * OpenSSH syslog lines:
 * {@code <ts> <host> sshd[<pid>]: Accepted|Failed <method> for <user> from <ip> port <port> ...}.
 * Anything after the port (usually {@code ssh2}) is ignored.
 */
public class AuthMatcher extends GrokLogFormatMatcher {

    public AuthMatcher() {
        super("^%{SSHD_AUTH_LINE}",
            List.of("timestamp", "hostname", "pid", "status", "auth_method", "username", "source_ip", "source_port"));
    }

    @Override
    public LogType type() {
        return LogType.AUTH;
    }

    @Override
    public boolean accepts(String line) {
        return line.contains("sshd[");
    }
}
