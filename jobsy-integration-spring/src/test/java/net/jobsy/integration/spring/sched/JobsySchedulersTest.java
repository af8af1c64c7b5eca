package net.jobsy.integration.spring.sched;

import net.jobsy.core.exception.StorePersistenceException;
import net.jobsy.core.service.CheckRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobsySchedulersTest {

    @Mock
    private CheckRunner checkRunner;

    @Test
    void tickRunsOneCheckCycle() throws Exception {
        new JobsySchedulers(checkRunner).tick();

        verify(checkRunner).runCheckCycle();
    }

    @Test
    void failedCycleDoesNotStopLaterTicks() throws Exception {
        when(checkRunner.runCheckCycle())
                .thenThrow(new StorePersistenceException("db down"))
                .thenReturn(null);
        JobsySchedulers schedulers = new JobsySchedulers(checkRunner);

        assertThatCode(schedulers::tick).doesNotThrowAnyException();
        assertThatCode(schedulers::tick).doesNotThrowAnyException();

        verify(checkRunner, times(2)).runCheckCycle();
    }
}
