package com.flowpilot.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.flowpilot.orchestrator.critic.CriticResult;
import com.flowpilot.orchestrator.tool.ToolNotFoundException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failure (and optionally a critic verdict) to an {@link ErrorClass}.
 *
 * Rules are tried in order and the first one that matches anywhere in the
 * cause chain wins:
 * <ol>
 *   <li>timeout or connectivity → TRANSIENT</li>
 *   <li>malformed input, missing key, unknown tool → TOOL_CONFIG</li>
 *   <li>critic score below {@value #QUALITY_FLOOR} → MODEL_QUALITY</li>
 *   <li>permission denied → REQUIRES_HUMAN</li>
 *   <li>anything else → PERMANENT</li>
 * </ol>
 */
public class ErrorClassifier {

    static final double QUALITY_FLOOR = 0.4;

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final List<Class<? extends Throwable>> TRANSIENT_TYPES = List.of(
            TimeoutException.class,
            SocketTimeoutException.class,
            ConnectException.class,
            NoRouteToHostException.class,
            UnknownHostException.class,
            HttpTimeoutException.class);

    private static final List<Class<? extends Throwable>> TOOL_CONFIG_TYPES = List.of(
            IllegalArgumentException.class,
            NoSuchElementException.class,
            ToolNotFoundException.class,
            JsonProcessingException.class);

    private static final List<Class<? extends Throwable>> HUMAN_TYPES = List.of(
            SecurityException.class,
            AccessDeniedException.class);

    public ErrorClass classify(Throwable failure) {
        return classify(failure, null);
    }

    public ErrorClass classify(Throwable failure, CriticResult criticResult) {
        List<Throwable> chain = causeChain(failure);
        if (anyInstanceOf(chain, TRANSIENT_TYPES)) {
            return ErrorClass.TRANSIENT;
        }
        if (anyInstanceOf(chain, TOOL_CONFIG_TYPES)) {
            return ErrorClass.TOOL_CONFIG;
        }
        if (criticResult != null && criticResult.score() < QUALITY_FLOOR) {
            return ErrorClass.MODEL_QUALITY;
        }
        if (anyInstanceOf(chain, HUMAN_TYPES)) {
            return ErrorClass.REQUIRES_HUMAN;
        }
        return ErrorClass.PERMANENT;
    }

    private static List<Throwable> causeChain(Throwable failure) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = failure;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static boolean anyInstanceOf(List<Throwable> chain, List<Class<? extends Throwable>> types) {
        for (Throwable t : chain) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(t)) {
                    return true;
                }
            }
        }
        return false;
    }
}
