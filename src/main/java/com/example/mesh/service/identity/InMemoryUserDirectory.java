package com.example.mesh.service.identity;

import com.example.mesh.domain.entity.User;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local {@link UserDirectory}. A single lock guards both indexes; it is held
 * only for one lookup or one check-and-insert.
 */
@Slf4j
public class InMemoryUserDirectory implements UserDirectory {

  private final Map<String, User> usersByEmail = new HashMap<>();
  private final Map<String, User> usersById = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  @Override
  public Optional<User> findByEmail(String email) {
    lock.lock();
    try {
      return Optional.ofNullable(usersByEmail.get(email));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<User> findById(String id) {
    lock.lock();
    try {
      return Optional.ofNullable(usersById.get(id));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean insertIfAbsent(User user) {
    lock.lock();
    try {
      if (usersByEmail.containsKey(user.email())) {
        return false;
      }
      usersByEmail.put(user.email(), user);
      usersById.put(user.id(), user);
    } finally {
      lock.unlock();
    }
    log.debug("Stored user {}", user.id());
    return true;
  }
}
