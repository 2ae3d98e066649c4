package com.codeheadsystems.latchkey.server.resource;

import com.codeheadsystems.latchkey.exceptions.UnknownKeyIdException;
import com.codeheadsystems.latchkey.model.lock.ErrorResponse;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link UnknownKeyIdException} to {@code 404 {"error":"unknown_key_id"}} so clients can
 * tell a retired key apart from a transport failure and fall back to recovery.
 */
@Provider
public class UnknownKeyIdExceptionMapper implements ExceptionMapper<UnknownKeyIdException> {

  private static final Logger log = LoggerFactory.getLogger(UnknownKeyIdExceptionMapper.class);

  @Override
  public Response toResponse(final UnknownKeyIdException exception) {
    log.debug("Unknown key id requested: {}", exception.keyId());
    return Response.status(Response.Status.NOT_FOUND)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(ErrorResponse.UNKNOWN_KEY_ID, exception.getMessage()))
        .build();
  }
}
