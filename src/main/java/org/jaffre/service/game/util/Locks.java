package org.jaffre.service.game.util;

import org.springframework.stereotype.Component;

import java.util.Objects;

/** Verrou par partie, réparti sur un nombre fixe de bandes. */
@Component
public class Locks {
    private final Object[] stripes = new Object[128];
    public Locks() { for (int i=0;i<stripes.length;i++) stripes[i] = new Object(); }
    public Object of(String gameId) {
        int idx = (Objects.hashCode(gameId) & 0x7fffffff) & (stripes.length - 1);
        return stripes[idx];
    }
}
