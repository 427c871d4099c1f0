package com.agentcrew.oracle;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;

public class OracleFailureException extends CrewException {

    public OracleFailureException(String message) {
        super(FailureCause.ORACLE_FAILURE, message);
    }

    public OracleFailureException(String message, Throwable cause) {
        super(FailureCause.ORACLE_FAILURE, message, cause);
    }
}
