package com.gentoro.agentops.exception;

/** The data store rejected a statement or could not be reached. */
public class DataStoreException extends AgentOpsException {
  public DataStoreException(String message) {
    super(AgentOpsErrorCode.DATA_STORE_ERROR, message);
  }

  public DataStoreException(String message, Throwable cause) {
    super(AgentOpsErrorCode.DATA_STORE_ERROR, message, cause);
  }
}
