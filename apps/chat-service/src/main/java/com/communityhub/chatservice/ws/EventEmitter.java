package com.communityhub.chatservice.ws;

/**
 * 向单个连接投递事件。
 */
public interface EventEmitter {

    void emit(Connection target, String event, Object payload);
}
