package com.taskpilot.repository;

import com.taskpilot.model.entity.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MessageRepository extends JpaRepository<Message, Long> {
    List<Message> findByConversationIdOrderByCreatedAtAscIdAsc(Long conversationId);

    List<Message> findByConversationIdOrderByCreatedAtDescIdDesc(Long conversationId, Pageable pageable);

    Optional<Message> findFirstByConversationIdOrderByCreatedAtDescIdDesc(Long conversationId);

    @Query("SELECT COUNT(m) FROM Message m WHERE m.conversationId = :id")
    long countByConversationId(@Param("id") Long conversationId);

    @Query("SELECT m.conversationId, COUNT(m) FROM Message m WHERE m.conversationId IN :ids GROUP BY m.conversationId")
    List<Object[]> countGroupedByConversationId(@Param("ids") Collection<Long> conversationIds);

    @Modifying
    @Query("DELETE FROM Message m WHERE m.conversationId = :id")
    int deleteByConversationId(@Param("id") Long conversationId);
}
