package com.gentoro.factcheck.model;

/** Creates model clients for one configured provider. */
public interface ModelClientFactory {

  /** Model name used when a request does not name one. */
  String defaultModel();

  ModelClient createChatClient(ModelSettings settings);

  VerificationModelClient createVerificationClient(ModelSettings settings);
}
