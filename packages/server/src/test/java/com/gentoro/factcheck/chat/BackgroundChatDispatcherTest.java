package com.gentoro.factcheck.chat;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BackgroundChatDispatcherTest {

  @Mock private ChatService chatService;

  @Test
  void assignsChatIdWhenMissing() {
    BackgroundChatDispatcher dispatcher =
        new BackgroundChatDispatcher(
            chatService, Executors.newSingleThreadExecutor(), () -> "gen-1");

    String chatId = dispatcher.submit(new ChatRequest("u-1", null, null, "hello", null, null));
    dispatcher.close();

    assertEquals("gen-1", chatId);
    ArgumentCaptor<ChatRequest> handled = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatService).handle(handled.capture());
    assertEquals("gen-1", handled.getValue().chatId());
    assertEquals("hello", handled.getValue().text());
  }

  @Test
  void keepsTheCallersChatId() {
    BackgroundChatDispatcher dispatcher =
        new BackgroundChatDispatcher(
            chatService, Executors.newSingleThreadExecutor(), () -> "gen-1");

    assertEquals(
        "c-7", dispatcher.submit(new ChatRequest("u-1", "c-7", null, "hello", null, null)));
    dispatcher.close();

    verify(chatService).handle(argThat(r -> "c-7".equals(r.chatId())));
  }

  @Test
  void failuresDoNotStopTheWorkers() {
    when(chatService.handle(any())).thenThrow(new IllegalStateException("boom")).thenReturn(null);
    BackgroundChatDispatcher dispatcher =
        new BackgroundChatDispatcher(chatService, Executors.newSingleThreadExecutor(), () -> "gen");

    dispatcher.submit(new ChatRequest("u-1", "c-1", null, "bad", null, null));
    dispatcher.submit(new ChatRequest("u-1", "c-2", null, "good", null, null));
    dispatcher.close();

    verify(chatService, times(2)).handle(any());
  }
}
