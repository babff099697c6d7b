package org.alphaminer.exceptions;

/**
 * The parameters file is missing, malformed or holds an out-of-range value.
 */
public class MinerConfigurationException extends MiningException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public MinerConfigurationException(String message, String parameter) {
        super(message, "configuration", parameter, "CONFIG_ERROR");
        this.parameter = parameter;
    }

    public MinerConfigurationException(String message, String parameter, Throwable cause) {
        super(message, cause, "configuration", parameter, "CONFIG_ERROR");
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
