package com.relayclaw.dispatch;

public enum DispatchState {
    CLASSIFY,
    SELECT_CANDIDATE,
    PROBE_NEXT,
    SEND,
    RECORD_FAILURE,
    DONE,
    EXHAUSTED
}
