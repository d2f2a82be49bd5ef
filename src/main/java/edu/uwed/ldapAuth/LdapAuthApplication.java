package edu.uwed.ldapAuth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LdapAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(LdapAuthApplication.class, args);
    }
}
