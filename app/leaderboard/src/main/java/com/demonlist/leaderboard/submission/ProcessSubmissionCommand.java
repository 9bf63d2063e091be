/*
 * どこで: 記録提出の照合
 * 何を: 提出内容を既存レコードと突き合わせ、新規レコードの作成・置き換え・拒否を決める
 * なぜ: BAN/レガシー/拡張リスト/重複の規則を決まった順で評価し、書き込みを 1 トランザクションに収めるため
 */
package com.demonlist.leaderboard.submission;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.InvalidProgressException;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.api.SubmissionExistsException;
import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.config.ListProperties;
import com.demonlist.leaderboard.model.DemonRecord;
import com.demonlist.leaderboard.model.PlayerRecord;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.model.RecordStatus;
import com.demonlist.leaderboard.model.Submission;
import com.demonlist.leaderboard.model.SubmitterRecord;
import com.demonlist.leaderboard.repository.ProgressRecordRepository;
import com.demonlist.leaderboard.video.VideoValidator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record ProcessSubmissionCommand(
    Submission submission,
    SubmitterRecord submitter,
    VideoValidator videoValidator,
    ListProperties listProperties)
    implements Command<Optional<ProgressRecord>> {

  private static final Logger logger = LoggerFactory.getLogger(ProcessSubmissionCommand.class);

  @Override
  public Optional<ProgressRecord> execute(CommandScope scope) {
    if (submitter.banned()) {
      throw new LeaderboardException(
          ApiErrorCode.BANNED_FROM_SUBMISSIONS, "you are banned from submitting records");
    }

    final ResolvedSubmission resolved =
        scope.dispatch(new ResolveSubmissionDataCommand(submission.player(), submission.demon()));
    final PlayerRecord player = resolved.player();
    final DemonRecord demon = resolved.demon();

    final String video =
        submission.video() == null ? null : videoValidator.validate(submission.video());

    if (player.banned()) {
      throw new LeaderboardException(
          ApiErrorCode.PLAYER_BANNED, "the holder of this record is banned");
    }
    if (demon.position() > listProperties.extendedSize()) {
      throw new LeaderboardException(
          ApiErrorCode.SUBMIT_LEGACY, "records for legacy demons are not accepted");
    }
    if (demon.position() > listProperties.size() && submission.progress() != 100) {
      throw new LeaderboardException(
          ApiErrorCode.NON_100_EXTENDED,
          "records for demons on the extended list must have 100% progress");
    }
    if (submission.progress() > 100 || submission.progress() < demon.requirement()) {
      throw new InvalidProgressException(demon.requirement());
    }

    final ProgressRecordRepository records = scope.session().records();
    final Optional<ProgressRecord> existing = records.findExisting(player.id(), demon.name(), video);
    if (existing.isPresent()) {
      final ProgressRecord found = existing.get();
      if (found.status() == RecordStatus.REJECTED || found.progress() >= submission.progress()) {
        throw new SubmissionExistsException(found.status(), found.id());
      }
    }
    if (submission.verifyOnly()) {
      return Optional.empty();
    }

    final int id =
        scope
            .session()
            .inTransaction(
                () -> {
                  // 承認済みは残し、審査待ちのものだけ新しい提出で置き換える
                  existing
                      .filter(found -> found.status() == RecordStatus.SUBMITTED)
                      .ifPresent(found -> records.deleteById(found.id()));
                  return records.insert(
                      submission.progress(), video, player.id(), submitter.id(), demon.name());
                });

    final ProgressRecord created =
        new ProgressRecord(
            id,
            submission.progress(),
            video,
            RecordStatus.SUBMITTED,
            player,
            submitter.id(),
            demon.embedded());
    logger.info(
        "record submitted id={} player={} demon={} progress={}",
        created.id(),
        player.name(),
        demon.name(),
        created.progress());
    return Optional.of(created);
  }
}
