package com.dropline.orderservice.mapper;

import com.dropline.orderservice.dto.ChatMessageResponse;
import com.dropline.orderservice.model.ChatMessage;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ChatMessageMapper {

    ChatMessageResponse toResponse(ChatMessage chatMessage);

    List<ChatMessageResponse> toResponses(List<ChatMessage> chatMessages);
}
