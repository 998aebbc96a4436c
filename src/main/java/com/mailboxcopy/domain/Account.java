package com.mailboxcopy.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Connection parameters of one IMAP account (source or destination)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String host;
    private int port;
    private SecurityMode securityMode;
    private String username;
    @ToString.Exclude
    private String password;
    private String initialFolder;   // Path component of the account URL, may be null

    public String describe() {
        String scheme = switch (securityMode) {
            case IMPLICIT_TLS -> "imaps";
            case STARTTLS -> "imap+starttls";
            case PLAIN -> "imap";
        };
        return scheme + "://" + username + "@" + host + ":" + port;
    }
}
