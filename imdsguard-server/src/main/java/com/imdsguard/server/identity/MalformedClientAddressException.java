package com.imdsguard.server.identity;

import com.imdsguard.server.guard.HandlerException;

/** The remote address could not be split into host and port. */
public class MalformedClientAddressException extends HandlerException {

    public MalformedClientAddressException(String address) {
        super(400, "unable to determine client identity", "incorrect format, expected ip:port, was: " + address);
    }
}
