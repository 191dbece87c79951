package com.example.feedreader.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStats {
    private String podId;
    private int activeSessions;
    private int distinctUsers;
    private long relayedMessages;
    private boolean listenerRunning;
    private long listenerRestarts;
}
