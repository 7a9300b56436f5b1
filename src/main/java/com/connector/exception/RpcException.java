package com.connector.exception;

/**
 * An RPC was resolved out of order, e.g. a nested child before its parent's value was chosen.
 */
public class RpcException extends ConnectorException {

    public RpcException(String message) {
        super(ErrorKind.RPC, message);
    }
}
