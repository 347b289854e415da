package com.example.streamhelper.application.domain.transaction;

import java.util.List;

import com.example.streamhelper.application.domain.event.EntityReference;
import com.example.streamhelper.application.domain.event.VersionedEvent;

import lombok.Value;

/**
 * 交易中等待提交的事件，以及需要一併收到副本的從屬實體
 */
@Value
public class PendingEvent {

	VersionedEvent event;

	List<EntityReference> affectedEntities;
}
