package com.codeheadsystems.latchkey.client.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.latchkey.client.model.AccountRecord;
import org.junit.jupiter.api.Test;

class InMemoryWrappedSecretStoreTest {

  @Test
  void saveLoadDelete() {
    InMemoryWrappedSecretStore store = new InMemoryWrappedSecretStore();
    AccountRecord record = FileWrappedSecretStoreTest.accountRecord("alice", null);

    store.save(record);

    assertThat(store.load("alice")).containsSame(record);
    assertThat(store.load("bob")).isEmpty();
    assertThat(store.delete("alice")).isTrue();
    assertThat(store.load("alice")).isEmpty();
  }
}
