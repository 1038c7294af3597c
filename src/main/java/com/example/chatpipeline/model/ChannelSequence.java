package com.example.chatpipeline.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("channel_sequences")
public class ChannelSequence {
    @Id
    private String channelId;
    private long seq;
}
