package com.demonlist.leaderboard.patch;

import com.demonlist.leaderboard.api.ModelNotFoundException;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.context.RequestContext;
import com.demonlist.leaderboard.model.Permission;
import com.demonlist.leaderboard.model.PermissionSet;
import com.demonlist.leaderboard.model.SubmitterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SubmitterPatchHandler
    implements PatchHandler<Integer, SubmitterRecord, SubmitterPatch> {

  private static final Logger logger = LoggerFactory.getLogger(SubmitterPatchHandler.class);

  private static final PermissionSet REQUIRED =
      PermissionSet.of(Permission.LIST_MODERATOR, Permission.LIST_ADMINISTRATOR);

  @Override
  public String model() {
    return "Submitter";
  }

  @Override
  public PermissionSet requiredPermissions(SubmitterPatch patch) {
    return REQUIRED;
  }

  @Override
  public SubmitterRecord load(RequestContext ctx, Integer id) {
    return ctx.session()
        .submitters()
        .findById(id)
        .orElseThrow(() -> new ModelNotFoundException("Submitter", id));
  }

  @Override
  public SubmitterRecord apply(
      CommandScope scope, RequestContext ctx, SubmitterRecord target, SubmitterPatch patch) {
    return patch.banned().isPresent() ? target.withBanned(patch.banned().value()) : target;
  }

  @Override
  public SubmitterRecord persist(
      RequestContext ctx, SubmitterRecord original, SubmitterRecord patched, SubmitterPatch patch) {
    ctx.session().submitters().updateBanned(patched.id(), patched.banned());
    if (patched.banned() && !original.banned()) {
      final int deleted = ctx.session().records().deleteSubmittedBySubmitter(patched.id());
      logger.info("banned submitter id={} deletedSubmissions={}", patched.id(), deleted);
    }
    return patched;
  }
}
