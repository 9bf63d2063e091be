package com.demonlist.leaderboard.submission;

import com.demonlist.leaderboard.command.Command;
import com.demonlist.leaderboard.command.CommandScope;
import com.demonlist.leaderboard.config.ListProperties;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.model.Submission;
import com.demonlist.leaderboard.model.SubmitterRecord;
import com.demonlist.leaderboard.operation.SubmitterByIpCommand;
import com.demonlist.leaderboard.video.VideoValidator;
import java.util.Optional;

// 外部からの提出の入口。提出元 IP の submitter 解決と照合を 1 つのワーカー実行にまとめる
public record SubmitRecordCommand(
    RequestData.External data,
    Submission submission,
    VideoValidator videoValidator,
    ListProperties listProperties)
    implements Command<Optional<ProgressRecord>> {

  @Override
  public Optional<ProgressRecord> execute(CommandScope scope) {
    scope.bind(data);
    final SubmitterRecord submitter = scope.dispatch(new SubmitterByIpCommand(data.ip()));
    return scope.dispatch(
        new ProcessSubmissionCommand(submission, submitter, videoValidator, listProperties));
  }
}
