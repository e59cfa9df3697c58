package com.foldermatch.app.recovery;

import com.foldermatch.app.model.ErrorSummary;
import com.foldermatch.app.model.RecoveryAction;
import com.foldermatch.app.model.RecoveryActionType;
import com.foldermatch.app.model.ResourceConstraintType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorRecoveryServiceTest {

    private final ErrorRecoveryService service = new ErrorRecoveryService(FakeNetworkProbe.local(), Duration.ZERO);

    @Test
    void accessDenied_isRetryWithElevationWithoutRetry() {
        RecoveryAction a = service.handleFileAccessError("/secret", new AccessDeniedException("/secret"));

        assertEquals(RecoveryActionType.RETRY_WITH_ELEVATION, a.type());
        assertFalse(a.shouldRetry());
        assertEquals(1, service.getSummary().permissionErrors());
    }

    @Test
    void notFoundAndPathTooLong_areSkipped() {
        assertEquals(RecoveryActionType.SKIP, service.handleFileAccessError("/gone", new NoSuchFileException("/gone")).type());
        assertEquals(RecoveryActionType.SKIP,
                service.handleFileAccessError("/long", new InvalidPathException("/long", "too long")).type());
    }

    @Test
    void locked_isRetriedAfterTwoSeconds() {
        RecoveryAction a = service.handleFileAccessError("/x",
                new FileSystemException("/x", null, "being used by another process"));
        assertEquals(RecoveryActionType.RETRY, a.type());
        assertTrue(a.shouldRetry());
        assertEquals(Duration.ofSeconds(2), a.retryDelay());
    }

    @Test
    void unknownError_isSkippedWithGenericMessage() {
        RecoveryAction a = service.handleFileAccessError("/x", new IOException("weird"));
        assertEquals(RecoveryActionType.SKIP, a.type());
        assertTrue(a.message().contains("weird"));
    }

    @Test
    void ioErrorOnUnreachableNetworkPath_pausesAndWaits() {
        FakeNetworkProbe probe = new FakeNetworkProbe(true, false);
        ErrorRecoveryService s = new ErrorRecoveryService(probe, Duration.ZERO);

        RecoveryAction a = s.handleFileAccessError("\\\\server\\share\\f", new IOException("network"));

        assertEquals(RecoveryActionType.PAUSE_AND_WAIT, a.type());
        assertEquals(Duration.ofSeconds(30), a.retryDelay());
        assertEquals(1, probe.probes.get());
        assertEquals(1, s.getSummary().networkErrors());
    }

    @Test
    void networkErrorOnReachablePath_retriesAfterFiveSeconds() {
        ErrorRecoveryService s = new ErrorRecoveryService(new FakeNetworkProbe(true, true), Duration.ZERO);
        RecoveryAction a = s.handleNetworkError("//server/share", new IOException("reset"));
        assertEquals(RecoveryActionType.RETRY, a.type());
        assertEquals(Duration.ofSeconds(5), a.retryDelay());
    }

    @Test
    void resourceConstraints_mapToExpectedActions() {
        assertEquals(RecoveryActionType.REDUCE_PARALLELISM,
                service.handleResourceConstraintError(ResourceConstraintType.MEMORY, new OutOfMemoryError()).type());
        assertEquals(RecoveryActionType.ABORT,
                service.handleResourceConstraintError(ResourceConstraintType.DISK_SPACE, new IOException()).type());
        assertEquals(RecoveryActionType.REDUCE_PARALLELISM,
                service.handleResourceConstraintError(ResourceConstraintType.FILE_HANDLES, new IOException()).type());
        assertEquals(RecoveryActionType.REDUCE_PARALLELISM,
                service.handleResourceConstraintError(ResourceConstraintType.CPU_USAGE, new IOException()).type());
        RecoveryAction bandwidth = service.handleResourceConstraintError(ResourceConstraintType.NETWORK_BANDWIDTH, null);
        assertEquals(RecoveryActionType.PAUSE_AND_WAIT, bandwidth.type());
        assertEquals(Duration.ofSeconds(10), bandwidth.retryDelay());

        assertEquals(5, service.getSummary().resourceErrors());
    }

    @Test
    void diskFullFileError_isRoutedToAbort() {
        RecoveryAction a = service.handleFileAccessError("/x", new FileSystemException("/x", null, "No space left on device"));
        assertTrue(a.isAbort());
    }

    @Test
    void summary_isADeepCopyAndCanBeCleared() {
        service.logSkippedItem("/a", "because");
        ErrorSummary first = service.getSummary();
        service.logSkippedItem("/b", "because");

        assertEquals(1, first.skippedFiles());
        assertEquals(1, first.skippedPaths().size());
        assertNotNull(first.lastErrorTime());
        assertEquals(2, service.getSummary().skippedFiles());

        service.clearSummary();
        ErrorSummary cleared = service.getSummary();
        assertFalse(cleared.hasErrors());
        assertTrue(cleared.errorMessages().isEmpty());
        assertNull(cleared.lastErrorTime());
    }

    @Test
    void neverThrowsEvenWhenTheReachabilityCheckFails() {
        NetworkProbe broken = new NetworkProbe() {
            @Override public boolean isNetworkPath(String path) { return true; }
            @Override public boolean isReachable(String path) { throw new IllegalStateException("rede fora"); }
        };
        ErrorRecoveryService s = new ErrorRecoveryService(broken, Duration.ZERO);
        RecoveryAction a = assertDoesNotThrow(() -> s.handleNetworkError("//srv/x", new IOException()));
        assertEquals(RecoveryActionType.PAUSE_AND_WAIT, a.type());
    }

    @Test
    void uncServerIsParsed() {
        assertEquals("server", NetworkProbe.uncServer("\\\\server\\share\\x"));
        assertEquals("nas", NetworkProbe.uncServer("//nas/media"));
        assertNull(NetworkProbe.uncServer("/local/path"));
    }
}
