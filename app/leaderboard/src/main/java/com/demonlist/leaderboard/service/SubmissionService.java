package com.demonlist.leaderboard.service;

import com.demonlist.leaderboard.command.CommandQueue;
import com.demonlist.leaderboard.config.ListProperties;
import com.demonlist.leaderboard.context.RequestData;
import com.demonlist.leaderboard.model.ProgressRecord;
import com.demonlist.leaderboard.model.Submission;
import com.demonlist.leaderboard.submission.SubmitRecordCommand;
import com.demonlist.leaderboard.video.VideoValidator;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class SubmissionService {

  private final CommandQueue commandQueue;
  private final VideoValidator videoValidator;
  private final ListProperties listProperties;

  // verifyOnly の提出は検証だけ行い、空を返す
  public Optional<ProgressRecord> submit(RequestData.External data, Submission submission) {
    return commandQueue.submit(
        new SubmitRecordCommand(data, submission, videoValidator, listProperties));
  }
}
