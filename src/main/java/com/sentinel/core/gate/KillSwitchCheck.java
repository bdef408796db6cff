package com.sentinel.core.gate;

import com.sentinel.core.policy.KillSwitchMode;

import java.util.UUID;

/**
 * One kill switch consulted during an evaluation.
 *
 * @param killSwitchId switch identity
 * @param key          switch key
 * @param mode         switch mode
 * @param scope        switch scope, rendered
 * @param triggered    whether the switch affected the outcome
 * @param detail       explanation
 */
public record KillSwitchCheck(
    UUID killSwitchId,
    String key,
    KillSwitchMode mode,
    String scope,
    boolean triggered,
    String detail
) {}
