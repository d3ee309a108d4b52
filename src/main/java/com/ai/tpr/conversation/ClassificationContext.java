package com.ai.tpr.conversation;

import lombok.Value;

import java.util.List;

/**
 * What a classifier may know about the session: where it is and what it can choose from.
 */
@Value
public class ClassificationContext {

    WorkflowStage stage;
    List<String> optionValues;
    Selections selections;
}
