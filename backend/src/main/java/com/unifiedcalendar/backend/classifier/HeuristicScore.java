package com.unifiedcalendar.backend.classifier;

import java.util.List;
import lombok.Value;

@Value
public class HeuristicScore {
    int score;
    // Names of the signals that contributed, e.g. "scheduling:interview"
    List<String> signals;
    boolean automatedSender;
}
