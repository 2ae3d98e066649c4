package com.codeheadsystems.latchkey.dropwizard.tasks;

import com.codeheadsystems.latchkey.shamir.CooperatorKeyManager;
import com.codeheadsystems.latchkey.shamir.RotationResult;
import io.dropwizard.servlets.tasks.Task;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /tasks/rotate-cooperator-key?keepInGrace=true|false}. The previous key stays in
 * the grace list unless {@code keepInGrace=false}.
 */
public class RotateCooperatorKeyTask extends Task {

  private static final Logger log = LoggerFactory.getLogger(RotateCooperatorKeyTask.class);

  private final CooperatorKeyManager keyManager;

  /**
   * Instantiates a new Rotate cooperator key task.
   *
   * @param keyManager the key manager
   */
  public RotateCooperatorKeyTask(CooperatorKeyManager keyManager) {
    super("rotate-cooperator-key");
    this.keyManager = keyManager;
  }

  @Override
  public void execute(Map<String, List<String>> parameters, PrintWriter output) {
    boolean keepInGrace = parameters.getOrDefault("keepInGrace", List.of("true")).stream()
        .findFirst()
        .map(Boolean::parseBoolean)
        .orElse(true);
    RotationResult result = keyManager.rotate(keepInGrace);
    log.info("Admin rotation: {} -> {}", result.previousKeyId(), result.currentKeyId());
    output.printf("currentKeyId=%s%npreviousKeyId=%s%ngraceKeyIds=%s%n",
        result.currentKeyId(), result.previousKeyId(), result.graceKeyIds());
    output.flush();
  }
}
