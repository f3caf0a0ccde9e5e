package com.causescore.evaluation;

public enum EvaluationStatus {
    SUCCESS,
    PARTIAL_SUCCESS
}
