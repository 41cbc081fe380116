package io.concourse.driver.transport;

import io.concourse.driver.ConcourseException;

/**
 * Login and logout exchange performed once per connection.
 */
public interface SessionHandshake {

    /**
     * @throws io.concourse.driver.AuthenticationException when the server rejects the credentials.
     */
    Credential login(String username, String password, String environment) throws ConcourseException;

    void logout(Credential credential, String environment) throws ConcourseException;
}
