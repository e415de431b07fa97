package com.taskpilot.service;

import com.taskpilot.model.entity.MessageRole;
import com.taskpilot.repository.ConversationRepository;
import com.taskpilot.repository.MessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// Real row locks need committed data and separate transactions per thread.
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties =
        "spring.datasource.url=jdbc:h2:mem:locking;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000")
@Import(ConversationService.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ConversationDeleteLockingTest {

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        messageRepository.deleteAll();
        conversationRepository.deleteAll();
    }

    @Test
    void deleteWaitsForInFlightAppendAndRemovesItsMessage() throws Exception {
        Long id = conversationService.getOrCreate(null, "alice", "hello").getId();
        conversationService.appendUserMessage(id, "hello");

        CountDownLatch rowLocked = new CountDownLatch(1);
        CountDownLatch finishAppend = new CountDownLatch(1);
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> append = executor.submit(() -> transaction.executeWithoutResult(status -> {
                conversationService.appendMessage(id, MessageRole.ASSISTANT, "hi");
                rowLocked.countDown();
                await(finishAppend);
            }));
            assertThat(rowLocked.await(5, TimeUnit.SECONDS)).isTrue();

            Future<Long> delete = executor.submit(() -> conversationService.delete(id, "alice"));
            assertThatThrownBy(() -> delete.get(300, TimeUnit.MILLISECONDS))
                    .isInstanceOf(TimeoutException.class);

            finishAppend.countDown();
            append.get(5, TimeUnit.SECONDS);

            assertThat(delete.get(10, TimeUnit.SECONDS)).isEqualTo(2L);
            assertThat(messageRepository.countByConversationId(id)).isZero();
            assertThat(conversationRepository.existsById(id)).isFalse();
        } finally {
            finishAppend.countDown();
            executor.shutdownNow();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
