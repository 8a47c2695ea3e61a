package com.lispjs;

public class UnknownNodeException extends CompileException {

    private final String nodeType;

    public UnknownNodeException(String nodeType) {
        super(ErrorKind.UNKNOWN_NODE_VARIANT, "Unknown node type: " + nodeType);
        this.nodeType = nodeType;
    }

    public String nodeType() {
        return nodeType;
    }
}
