package com.linggate.sample.service;

import org.springframework.stereotype.Service;

@Service
public class GreeterService {

    public String sayHello(String name) {
        return "Hello, " + name;
    }

    public String sayHelloOther(String name) {
        return "Hello from the other app, " + name;
    }

    public String sayHelloRealm(String name) {
        return "Hello, realm admin " + name;
    }

    public String sayHelloCustom(String name) {
        return "Hello, tenant user " + name;
    }

    public String sayHelloPublic(String name) {
        return "Hello, stranger " + name;
    }

    public String sayHelloMultiple(String name) {
        return "Hello again, " + name;
    }

    public String sayGoodbye(String name) {
        return "Goodbye, " + name;
    }
}
