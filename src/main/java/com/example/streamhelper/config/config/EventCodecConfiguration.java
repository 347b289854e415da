package com.example.streamhelper.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.streamhelper.infra.event.codec.EventJsonCodec;
import com.example.streamhelper.infra.event.mapper.EventStoreEventMapper;

import tools.jackson.databind.ObjectMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 事件內容、metadata 與快照共用同一個 Spring 管理的 ObjectMapper。
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	@Bean
	public EventJsonCodec eventJsonCodec(ObjectMapper objectMapper) {
		return new EventJsonCodec(objectMapper);
	}

	@Bean
	public EventStoreEventMapper eventStoreEventMapper(EventJsonCodec eventJsonCodec) {
		return new EventStoreEventMapper(eventJsonCodec);
	}
}
