package com.gt.practice.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gt.practice.composer.Composition;
import com.gt.practice.model.SessionSnapshot;

// snapshot is null when the composition came out empty and no session was stored
public record CreatedSession(SessionSnapshot snapshot, Composition composition) {

    @JsonIgnore
    public boolean hasSession() {
        return snapshot != null;
    }
}
