package com.codeheadsystems.latchkey.dropwizard.tasks;

import com.codeheadsystems.latchkey.shamir.CooperatorKeyManager;
import io.dropwizard.servlets.tasks.Task;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /tasks/remove-grace-key?keyId=...}. Blobs still locked under that key must go
 * through recovery afterwards.
 */
public class RemoveGraceKeyTask extends Task {

  private static final Logger log = LoggerFactory.getLogger(RemoveGraceKeyTask.class);

  private final CooperatorKeyManager keyManager;

  /**
   * Instantiates a new Remove grace key task.
   *
   * @param keyManager the key manager
   */
  public RemoveGraceKeyTask(CooperatorKeyManager keyManager) {
    super("remove-grace-key");
    this.keyManager = keyManager;
  }

  @Override
  public void execute(Map<String, List<String>> parameters, PrintWriter output) {
    List<String> keyIds = parameters.getOrDefault("keyId", List.of());
    if (keyIds.isEmpty()) {
      output.println("Missing required parameter: keyId");
      output.flush();
      return;
    }
    for (String keyId : keyIds) {
      boolean removed = keyManager.removeGraceKey(keyId);
      log.info("Admin remove-grace-key {} -> {}", keyId, removed);
      output.printf("%s: %s%n", keyId, removed ? "removed" : "not in grace list");
    }
    output.flush();
  }
}
