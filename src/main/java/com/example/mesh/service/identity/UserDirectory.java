package com.example.mesh.service.identity;

import com.example.mesh.domain.entity.User;
import java.util.Optional;

/**
 * Storage abstraction for registered users, keyed uniquely by email.
 * <p>
 * Implementations must be thread-safe and must make {@link #insertIfAbsent} atomic
 * with respect to concurrent registrations of the same email.
 */
public interface UserDirectory {

  /**
   * @param email exact email as registered (case-sensitive)
   * @return the user, or empty if no user has that email
   */
  Optional<User> findByEmail(String email);

  /**
   * @param id user id as issued at registration
   * @return the user, or empty if no user has that id
   */
  Optional<User> findById(String id);

  /**
   * Stores the user unless the email is already taken.
   *
   * @param user the new user
   * @return true if stored, false if a user with the same email already exists
   */
  boolean insertIfAbsent(User user);
}
