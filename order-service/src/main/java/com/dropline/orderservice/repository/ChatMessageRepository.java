package com.dropline.orderservice.repository;

import com.dropline.orderservice.model.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

    List<ChatMessage> findByOrderIdOrderByCreatedAtAsc(UUID orderId);
}
