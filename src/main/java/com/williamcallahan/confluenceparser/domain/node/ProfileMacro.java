package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.UserReference;
import java.util.List;

public final class ProfileMacro extends MacroNode {

    private final UserReference user;

    public ProfileMacro(MacroDescriptor descriptor, UserReference user, NodeScope scope) {
        super(NodeType.PROFILE_MACRO, descriptor, List.of(), scope);
        this.user = user;
    }

    public ProfileMacro(UserReference user) {
        this(MacroDescriptor.of("profile"), user, NodeScope.NONE);
    }

    public UserReference user() {
        return user;
    }

    public String accountId() {
        return user == null ? null : user.accountId();
    }
}
