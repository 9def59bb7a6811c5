package io.github.goodees.cqrs.infrastructure;

/*-
 * #%L
 * cqrs-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.cqrs.CqrsConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs asynchronous I/O operations until the external system cooperates. Every interaction of the runtime with
 * stores and publishers goes through this class.
 * <p>Every attempt ends with one of the outcomes of {@link Outcome}:</p>
 * <ul>
 *     <li>{@link Outcome#SUCCESS} passes the result to success action. Business outcomes reported by a store, such
 *     as a duplicate event, are results too.</li>
 *     <li>{@link Outcome#RETRY} schedules another attempt. Failures caused by {@link IOException} are always
 *     retried, other failures only when the call site asks for it.</li>
 *     <li>{@link Outcome#FAILED} passes the error message to the failed action of the call site.</li>
 *     <li>{@link Outcome#FATAL} is an outcome that may never happen in correct deployment, such as an action that
 *     produced no stage, or exhausted retry cap. It is logged with {@link Markers#FATAL} and passed to failed
 *     action.</li>
 * </ul>
 * <p>Retries are unlimited unless {@link CqrsConfiguration#maxRetryAttempts()} says otherwise. First
 * {@link CqrsConfiguration#immediateRetries()} retries are submitted right away, the later ones are delayed by
 * {@link CqrsConfiguration#retryDelayMillis()}.</p>
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final CqrsConfiguration conf;

    public RetryExecutor(CqrsConfiguration conf) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
    }

    /**
     * Classification of single attempt.
     */
    public enum Outcome {
        SUCCESS, RETRY, FAILED, FATAL
    }

    /**
     * Start executing an action.
     * @param actionName name of the action for log messages
     * @param action the action. Called once per attempt
     * @param successAction receives the result of the successful attempt
     * @param contextInfo describes the context of the call for log messages
     * @param failedAction receives error message when the action will not be retried anymore
     * @param retryWhenFailed whether failures not caused by I/O should be retried too
     * @param <T> type of result
     */
    public <T> void execute(String actionName, Supplier<? extends CompletionStage<T>> action,
            Consumer<? super T> successAction, Supplier<String> contextInfo, Consumer<String> failedAction,
            boolean retryWhenFailed) {
        new Attempt<T>(actionName, action, successAction, contextInfo, failedAction, retryWhenFailed).run();
    }

    /**
     * Classify failure of an attempt.
     * @param error the failure, null for successful attempt
     * @param retryWhenFailed whether call site retries non I/O failures
     * @return outcome of an attempt, never {@link Outcome#FATAL}, which is decided by the executor itself
     */
    public static Outcome classify(Throwable error, boolean retryWhenFailed) {
        if (error == null) {
            return Outcome.SUCCESS;
        }
        if (isTransient(error) || retryWhenFailed) {
            return Outcome.RETRY;
        }
        return Outcome.FAILED;
    }

    /**
     * Whether an error was caused by I/O.
     * @param error error to inspect
     * @return true if {@link IOException} is found in the cause chain
     */
    public static boolean isTransient(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof IOException || t instanceof UncheckedIOException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
            t = t.getCause();
        }
        return false;
    }

    /**
     * Strip wrappers added by asynchronous execution.
     * @param ex exception to unwrap
     * @return the innermost cause which is not a wrapper
     */
    public static Throwable unwrap(Throwable ex) {
        while (ex != null && ex.getCause() != null
                && (ex instanceof CompletionException || ex instanceof ExecutionException)) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Single execution of the action along with its retries. Lifecycle: attempt, classify the outcome, act.
     * The only state carried between attempts is the number of retries.
     */
    final class Attempt<T> implements Runnable {
        private final String actionName;
        private final Supplier<? extends CompletionStage<T>> action;
        private final Consumer<? super T> successAction;
        private final Supplier<String> contextInfo;
        private final Consumer<String> failedAction;
        private final boolean retryWhenFailed;
        private int retryTimes;

        Attempt(String actionName, Supplier<? extends CompletionStage<T>> action, Consumer<? super T> successAction,
                Supplier<String> contextInfo, Consumer<String> failedAction, boolean retryWhenFailed) {
            this.actionName = actionName;
            this.action = action;
            this.successAction = successAction;
            this.contextInfo = contextInfo;
            this.failedAction = failedAction;
            this.retryWhenFailed = retryWhenFailed;
        }

        @Override
        public void run() {
            CompletionStage<T> stage;
            try {
                stage = action.get();
            } catch (RuntimeException e) {
                act(null, e);
                return;
            }
            if (stage == null) {
                fatal("Async action '" + actionName + "' returned no result");
                return;
            }
            stage.whenComplete(this::act);
        }

        private void act(T result, Throwable failure) {
            Throwable error = unwrap(failure);
            switch (classify(error, retryWhenFailed)) {
                case SUCCESS:
                    succeeded(result);
                    break;
                case RETRY:
                    retry(error);
                    break;
                default:
                    failed(error);
                    break;
            }
        }

        private void succeeded(T result) {
            try {
                successAction.accept(result);
            } catch (RuntimeException e) {
                logger.error(Markers.FATAL, "Failed to execute the success action of '{}', context: {}",
                        actionName, describe(), e);
            }
        }

        private void retry(Throwable error) {
            retryTimes++;
            int cap = conf.maxRetryAttempts();
            if (cap != CqrsConfiguration.UNLIMITED_RETRIES && retryTimes > cap) {
                fatal("Async action '" + actionName + "' gave up after " + cap + " retries, last error: "
                        + error);
                return;
            }
            if (isTransient(error)) {
                logger.warn("Async action '{}' has I/O exception, context: {}, retry times: {}", actionName,
                        describe(), retryTimes, error);
            } else {
                logger.error("Async action '{}' failed, context: {}, retry times: {}", actionName, describe(),
                        retryTimes, error);
            }
            if (retryTimes <= conf.immediateRetries()) {
                conf.executorService().execute(this);
            } else {
                conf.schedulerService().schedule(() -> conf.executorService().execute(this),
                        conf.retryDelayMillis(), TimeUnit.MILLISECONDS);
            }
        }

        private void failed(Throwable error) {
            logger.error("Async action '{}' failed, context: {}", actionName, describe(), error);
            invokeFailedAction(error.getClass().getSimpleName() + ": " + error.getMessage());
        }

        private void fatal(String message) {
            logger.error(Markers.FATAL, "{}, context: {}", message, describe());
            invokeFailedAction(message);
        }

        private void invokeFailedAction(String message) {
            try {
                failedAction.accept(message);
            } catch (RuntimeException e) {
                logger.error(Markers.FATAL, "Failed to execute the failed action of '{}', context: {}",
                        actionName, describe(), e);
            }
        }

        private String describe() {
            try {
                return contextInfo.get();
            } catch (RuntimeException e) {
                return "<" + e + ">";
            }
        }
    }
}
